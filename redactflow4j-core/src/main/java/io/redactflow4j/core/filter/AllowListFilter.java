/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.filter;

import io.redactflow4j.core.api.model.Discard;
import io.redactflow4j.core.api.model.DiscardReason;
import io.redactflow4j.core.api.model.EntityCandidate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class AllowListFilter {
    private final AllowList allowList;

    public AllowListFilter(AllowList allowList) {
        this.allowList = Objects.requireNonNull(allowList, "allowList");
    }

    public List<EntityCandidate> filter(String text, List<EntityCandidate> candidates, List<Discard> discards) {
        if (allowList.isEmpty()) return candidates;
        List<EntityCandidate> out = new ArrayList<>(candidates.size());
        for (EntityCandidate c : candidates) {
            if (allowList.allows(c.text(text))) {
                discards.add(Discard.of(c, DiscardReason.ALLOW_LISTED, ""));
            } else {
                out.add(c);
            }
        }
        return out;
    }
}
