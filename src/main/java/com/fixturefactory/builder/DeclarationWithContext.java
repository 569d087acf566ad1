package com.fixturefactory.builder;

import java.util.Map;

import com.fixturefactory.declaration.Declaration;

import lombok.NonNull;
import lombok.Value;

/**
 * A top-level declaration together with the nested overrides routed to it.
 */
@Value
public class DeclarationWithContext {

    @NonNull
    String name;

    @NonNull
    Declaration declaration;

    @NonNull
    Map<String, Object> context;
}
