package com.fixturefactory.util;

import com.fixturefactory.exception.UnknownAttributeException;

/**
 * Something that exposes named attributes without going through JavaBean reflection.
 */
public interface AttributeSource {

    /**
     * @throws UnknownAttributeException if {@code name} is not available
     */
    Object getAttribute(String name);
}
