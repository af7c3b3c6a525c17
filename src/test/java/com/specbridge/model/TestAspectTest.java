package com.specbridge.model;

import com.specbridge.assertion.AssertResult;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestAspectTest {

    @Test
    public void ignore_onSuiteMarksEveryTestBelowIt() {
        Spec spec = Spec.suite("root",
            Spec.test("a", AssertResult::success),
            Spec.suite("nested", Spec.test("b", AssertResult::success)))
            .with(TestAspect.ignore());

        SuiteSpec root = (SuiteSpec) spec;
        TestSpec a = (TestSpec) root.children().get(0);
        TestSpec b = (TestSpec) ((SuiteSpec) root.children().get(1)).children().get(0);
        assertThat(a.ignored()).isTrue();
        assertThat(b.ignored()).isTrue();
        assertThat(root.label()).isEqualTo("root");
    }

    @Test
    public void tagged_mergesWithExistingTags() {
        TestSpec test = (TestSpec) Spec.test("t", AssertResult::success)
            .with(TestAspect.tagged("slow"))
            .with(TestAspect.tagged("db", "slow"));

        assertThat(test.tags()).containsExactlyInAnyOrder("slow", "db");
        assertThat(test.ignored()).isFalse();
    }

    @Test
    public void tagged_toleratesRepeatedTags() {
        TestSpec test = (TestSpec) Spec.test("t", AssertResult::success)
            .with(TestAspect.tagged("slow", "slow"));

        assertThat(test.tags()).containsExactly("slow");
    }

    @Test
    public void tagged_rejectsNullTag() {
        assertThatThrownBy(() -> TestAspect.tagged("slow", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must not be null");
    }

    @Test
    public void aspects_leaveTheOriginalSpecUntouched() {
        TestSpec original = Spec.test("t", AssertResult::success);

        original.with(TestAspect.ignore());

        assertThat(original.ignored()).isFalse();
    }
}
