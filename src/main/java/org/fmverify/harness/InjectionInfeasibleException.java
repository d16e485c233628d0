package org.fmverify.harness;

import org.fmverify.model.ModelException;

/**
 * Il modello non ha abbastanza feature candidate per l'iniezione. Recuperabile: il modello
 * viene saltato e registrato.
 */
public class InjectionInfeasibleException extends ModelException {

    private final int candidateCount;

    public InjectionInfeasibleException(String message, int candidateCount) {
        super(message);
        this.candidateCount = candidateCount;
    }

    public int getCandidateCount() {
        return candidateCount;
    }
}
