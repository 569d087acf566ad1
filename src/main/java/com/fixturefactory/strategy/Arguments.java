package com.fixturefactory.strategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.NonNull;
import lombok.Value;

/**
 * Final positional and keyword arguments for one model instantiation,
 * after rename, exclusion and inline-argument extraction.
 */
@Value
public class Arguments {

    /**
     * Values pulled out of the keyword arguments in inline-args order.
     */
    @NonNull
    List<Object> args;

    /**
     * Remaining attributes by target name, in declaration order.
     */
    @NonNull
    Map<String, Object> kwargs;

    public static Arguments of(List<Object> args, Map<String, Object> kwargs) {
        return new Arguments(
                Collections.unmodifiableList(new ArrayList<>(args)),
                Collections.unmodifiableMap(new LinkedHashMap<>(kwargs)));
    }
}
