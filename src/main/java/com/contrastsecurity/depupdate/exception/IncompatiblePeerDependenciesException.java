package com.contrastsecurity.depupdate.exception;

import com.contrastsecurity.depupdate.model.PeerViolation;

import java.util.Collections;
import java.util.List;

/**
 * Exception thrown when peer dependency validation reported at least one violation
 * and the update was not forced. The individual violations have already been logged.
 */
public class IncompatiblePeerDependenciesException extends UpdateException {

    private final List<PeerViolation> violations;

    public IncompatiblePeerDependenciesException(List<PeerViolation> violations) {
        super("Incompatible peer dependencies found. See above.");
        this.violations = Collections.unmodifiableList(violations);
    }

    public List<PeerViolation> getViolations() {
        return violations;
    }
}
