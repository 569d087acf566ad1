package com.fixturefactory.fixtures;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * Records saves in a static journal so persistence can be asserted.
 */
@Data
public class Ledger {
    public static final List<Ledger> SAVED = new ArrayList<>();

    private String code;
    private boolean saved;

    public void save() {
        saved = true;
        SAVED.add(this);
    }
}
