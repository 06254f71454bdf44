package com.anamnesis.reasoning;

import com.anamnesis.model.FragmentRef;

public record ReferenceEdge(FragmentRef from, FragmentRef to) {

    public boolean crossesConversations() {
        return from.conversationId() == null
                ? to.conversationId() != null
                : !from.conversationId().equals(to.conversationId());
    }
}
