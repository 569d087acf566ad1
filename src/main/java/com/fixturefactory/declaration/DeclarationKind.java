package com.fixturefactory.declaration;

/**
 * Tag of every {@link Declaration} variant.
 */
public enum DeclarationKind {
    STATIC_VALUE,
    SEQUENCE,
    LAZY_ATTRIBUTE_SEQUENCE,
    LAZY_FUNCTION,
    LAZY_ATTRIBUTE,
    SELF_ATTRIBUTE,
    CONTAINER_ATTRIBUTE,
    ITERATOR,
    SUB_FACTORY,
    DICT,
    LIST,
    MAYBE,
    TRANSFORMER,
    TRAIT,
    POST_GENERATION,
    POST_GENERATION_METHOD_CALL,
    RELATED_FACTORY,
    RELATED_FACTORY_LIST
}
