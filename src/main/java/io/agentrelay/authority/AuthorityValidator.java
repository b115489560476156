package io.agentrelay.authority;

import io.agentrelay.model.Envelope;

/**
 * Gate consulted before an envelope that requires an authority check is
 * routed. Implementations must be side-effect free from the broker's point of
 * view and safe to call from many sending threads at once.
 */
@FunctionalInterface
public interface AuthorityValidator {
    ValidationOutcome validate(Envelope envelope);
}
