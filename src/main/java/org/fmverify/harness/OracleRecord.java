package org.fmverify.harness;

/**
 * Verità di riferimento di un'iniezione: quali feature sono state colpite e in quale file.
 *
 * @param fileName nome del file iniettato
 * @param sourceFile nome del file pulito di partenza
 * @param deadFeature bersaglio di {@code root => !d}
 * @param falseOptionalFeature bersaglio di {@code root => f}
 * @param redundantFeature sorgente di {@code r => root}
 */
public record OracleRecord(String fileName, String sourceFile, String deadFeature,
                           String falseOptionalFeature, String redundantFeature) {
}
