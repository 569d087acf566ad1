package com.fixturefactory.builder;

import lombok.NonNull;
import lombok.Value;

/**
 * Declarations split by phase.
 */
@Value
public class ParsedDeclarations {

    @NonNull
    DeclarationSet pre;

    @NonNull
    DeclarationSet post;
}
