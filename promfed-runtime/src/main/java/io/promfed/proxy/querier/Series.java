/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.querier;

import io.promfed.proxy.model.LabelSet;

public interface Series {

    LabelSet labels();

    /**
     * @return a new iterator, positioned before the first sample
     */
    SampleIterator iterator();
}
