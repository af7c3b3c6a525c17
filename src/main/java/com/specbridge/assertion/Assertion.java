package com.specbridge.assertion;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A named predicate over a value.
 *
 * The rendering is what appears in failure output, e.g. {@code equalTo(2)} renders as
 * {@code equals(2)} so a failed check reads {@code 1 did not satisfy equals(2)}.
 */
public final class Assertion<A> {

    private final String             rendering;
    private final Predicate<A>       predicate;
    private final List<Assertion<A>> conjuncts;   // non-empty only for and()

    private Assertion(String rendering, Predicate<A> predicate, List<Assertion<A>> conjuncts) {
        this.rendering = rendering;
        this.predicate = predicate;
        this.conjuncts = conjuncts;
    }

    public static <A> Assertion<A> of(String rendering, Predicate<A> predicate) {
        return new Assertion<>(rendering, predicate, List.of());
    }

    // ── Built-ins ─────────────────────────────────────────────────────────────

    public static <A> Assertion<A> equalTo(A expected) {
        return of("equals(" + expected + ")", actual -> Objects.equals(actual, expected));
    }

    public static <A> Assertion<A> isNull() {
        return of("isNull", Objects::isNull);
    }

    public static Assertion<Boolean> isTrue() {
        return of("isTrue", Boolean.TRUE::equals);
    }

    public static Assertion<Boolean> isFalse() {
        return of("isFalse", Boolean.FALSE::equals);
    }

    public static <A extends Comparable<A>> Assertion<A> isGreaterThan(A reference) {
        return of("isGreaterThan(" + reference + ")", actual -> actual != null && actual.compareTo(reference) > 0);
    }

    public static <A extends Comparable<A>> Assertion<A> isLessThan(A reference) {
        return of("isLessThan(" + reference + ")", actual -> actual != null && actual.compareTo(reference) < 0);
    }

    public static Assertion<String> containsString(String fragment) {
        return of("containsString(" + fragment + ")", actual -> actual != null && actual.contains(fragment));
    }

    public static <A> Assertion<A> not(Assertion<A> assertion) {
        return of("not(" + assertion.rendering + ")", assertion.predicate.negate());
    }

    // ── Combinators ───────────────────────────────────────────────────────────

    /** Holds when both hold; {@link Assert#that} reports each failing side separately. */
    public Assertion<A> and(Assertion<A> other) {
        List<Assertion<A>> parts = new ArrayList<>(parts());
        parts.addAll(other.parts());
        return new Assertion<>("(" + rendering + " && " + other.rendering + ")",
            predicate.and(other.predicate), List.copyOf(parts));
    }

    public Assertion<A> or(Assertion<A> other) {
        return of("(" + rendering + " || " + other.rendering + ")", predicate.or(other.predicate));
    }

    public boolean test(A actual) {
        return predicate.test(actual);
    }

    /** The independently reported parts: the conjuncts of an {@code and}, or this assertion itself. */
    List<Assertion<A>> parts() {
        return conjuncts.isEmpty() ? List.of(this) : conjuncts;
    }

    public String render() {
        return rendering;
    }

    @Override
    public String toString() {
        return rendering;
    }
}
