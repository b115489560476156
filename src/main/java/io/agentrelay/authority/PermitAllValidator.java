package io.agentrelay.authority;

import io.agentrelay.model.Envelope;

public final class PermitAllValidator implements AuthorityValidator {
    @Override
    public ValidationOutcome validate(Envelope envelope) {
        return ValidationOutcome.allow();
    }
}
