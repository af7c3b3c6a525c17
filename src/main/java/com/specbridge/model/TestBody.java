package com.specbridge.model;

import com.specbridge.assertion.AssertResult;

/**
 * The executable part of a {@link TestSpec}.
 *
 * A body reports its outcome by returning an {@link AssertResult}. Throwing is also
 * allowed; any throwable raised here is caught by the executor and recorded as a
 * failure of this test only.
 */
@FunctionalInterface
public interface TestBody {
    AssertResult run() throws Exception;
}
