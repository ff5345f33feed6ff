package com.leakscope.core.pattern;

import com.leakscope.core.error.PatternValidationException;
import com.leakscope.core.model.Category;
import com.leakscope.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PatternRegistryTest {

    private static PatternDefinition.Builder minimal(String id) {
        return PatternDefinition.builder().id(id).name(id + " name").regex("abc");
    }

    @Test
    @DisplayName("필수 필드만 주면 기본값(0.8 / secrets / medium / 대소문자 무시) 적용")
    void register_appliesDefaults() {
        PatternRegistry reg = new PatternRegistry();
        PatternDefinition p = reg.register(minimal("p1"));

        assertThat(p.getConfidence()).isEqualTo(0.8);
        assertThat(p.getCategory()).isEqualTo(Category.SECRETS);
        assertThat(p.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(p.getFalsePositiveFilters()).isEmpty();
        assertThat(p.getRegex().matcher("xxABCxx").find()).isTrue();
        assertThat(reg.get("p1")).isSameAs(p);
    }

    @Test
    void register_acceptsTextCategoryAndSeverity_caseInsensitive() {
        PatternRegistry reg = new PatternRegistry();
        PatternDefinition p = reg.register(minimal("p1").category("Configurations").severity("CRITICAL"));

        assertThat(p.getCategory()).isEqualTo(Category.CONFIGURATIONS);
        assertThat(p.getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void register_rejectsMissingRequiredFields() {
        PatternRegistry reg = new PatternRegistry();

        assertThatThrownBy(() -> reg.register(PatternDefinition.builder().name("n").regex("a")))
                .isInstanceOf(PatternValidationException.class).hasMessageContaining("id");
        assertThatThrownBy(() -> reg.register(PatternDefinition.builder().id("x").regex("a")))
                .isInstanceOf(PatternValidationException.class).hasMessageContaining("name");
        assertThatThrownBy(() -> reg.register(PatternDefinition.builder().id("x").name("n")))
                .isInstanceOf(PatternValidationException.class).hasMessageContaining("regex");
        assertThat(reg.size()).isZero();
    }

    @Test
    void register_rejectsValuesOutsideAllowLists() {
        PatternRegistry reg = new PatternRegistry();

        assertThatThrownBy(() -> reg.register(minimal("a").category("misc")))
                .isInstanceOf(PatternValidationException.class).hasMessageContaining("category");
        assertThatThrownBy(() -> reg.register(minimal("b").severity("urgent")))
                .isInstanceOf(PatternValidationException.class).hasMessageContaining("severity");
        assertThatThrownBy(() -> reg.register(minimal("c").confidence(1.5)))
                .isInstanceOf(PatternValidationException.class).hasMessageContaining("confidence");
        assertThatThrownBy(() -> reg.register(minimal("d").regex("(unclosed")))
                .isInstanceOf(PatternValidationException.class).hasMessageContaining("invalid regex");
        assertThatThrownBy(() -> reg.register(minimal("e").regex("k(ey)").extractGroup(2)))
                .isInstanceOf(PatternValidationException.class).hasMessageContaining("extractGroup");
        assertThatThrownBy(() -> reg.register(minimal("f").minLength(10).maxLength(5)))
                .isInstanceOf(PatternValidationException.class);
    }

    @Test
    void register_rejectsDuplicateId() {
        PatternRegistry reg = new PatternRegistry();
        reg.register(minimal("dup"));

        assertThatThrownBy(() -> reg.register(minimal("dup")))
                .isInstanceOf(PatternValidationException.class)
                .satisfies(e -> assertThat(((PatternValidationException) e).getPatternId()).isEqualTo("dup"));
        assertThat(reg.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("조회 순서: 카테고리 선언 순서 → 같은 카테고리 안에서는 등록 순서")
    void patternsFor_keepsCategoryThenRegistrationOrder() {
        PatternRegistry reg = new PatternRegistry();
        reg.registerAll(List.of(
                minimal("v1").category(Category.VULNERABILITIES),
                minimal("s1"),
                minimal("c1").category(Category.CONFIGURATIONS),
                minimal("s2")));

        assertThat(reg.patternsFor(null)).extracting(PatternDefinition::getId)
                .containsExactly("s1", "s2", "v1", "c1");
        assertThat(reg.patternsFor(EnumSet.of(Category.CONFIGURATIONS, Category.VULNERABILITIES)))
                .extracting(PatternDefinition::getId).containsExactly("v1", "c1");
    }

    @Test
    void registerAll_stopsAtFirstInvalidEntry() {
        PatternRegistry reg = new PatternRegistry();

        assertThatThrownBy(() -> reg.registerAll(List.of(minimal("ok"), minimal("bad").severity("nope"), minimal("never"))))
                .isInstanceOf(PatternValidationException.class);
        assertThat(reg.get("ok")).isNotNull();
        assertThat(reg.get("never")).isNull();
    }

    @Test
    void stats_countsPerCategory_andClearEmptiesRegistry() {
        PatternRegistry reg = new PatternRegistry();
        reg.register(minimal("s1"));
        reg.register(minimal("s2"));
        reg.register(minimal("v1").category(Category.VULNERABILITIES).severity(Severity.HIGH));

        PatternRegistry.Stats stats = reg.stats();
        assertThat(stats.total()).isEqualTo(3);
        assertThat(stats.byCategory()).containsEntry(Category.SECRETS, 2)
                .containsEntry(Category.VULNERABILITIES, 1)
                .containsEntry(Category.CONFIGURATIONS, 0);
        assertThat(stats.patterns()).extracting(PatternRegistry.Summary::id).containsExactly("s1", "s2", "v1");

        reg.clear();
        assertThat(reg.size()).isZero();
        assertThat(reg.patternsFor(null)).isEmpty();
    }
}
