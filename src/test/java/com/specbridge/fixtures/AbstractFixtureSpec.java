package com.specbridge.fixtures;

import com.specbridge.framework.RunnableSpec;
import com.specbridge.model.Spec;

/** Never discovered or run on its own. */
public abstract class AbstractFixtureSpec extends RunnableSpec {

    protected AbstractFixtureSpec(Spec spec) {
        super(spec);
    }
}
