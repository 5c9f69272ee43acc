package org.broadinstitute.varanno.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.aeonbits.owner.Mutable;

/**
 * Configuration for variant annotation.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is:
 *        1)   "file:${" + VarAnnoConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "classpath:${" + VarAnnoConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
 *        3)   "file:VarAnnoConfig.properties",
 *        4)   "classpath:org/broadinstitute/varanno/utils/config/VarAnnoConfig.properties"
 *        5)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + VarAnnoConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
        "classpath:${" + VarAnnoConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
        "file:VarAnnoConfig.properties",
        "classpath:org/broadinstitute/varanno/utils/config/VarAnnoConfig.properties"
})
public interface VarAnnoConfig extends Mutable, Accessible {

    /**
     * Name of the variable in the {@link Sources} annotation naming a configuration file on disk.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "VarAnnoConfig.pathToConfig";

    /**
     * Name of the variable in the {@link Sources} annotation naming a configuration file on the class path.
     */
    String CONFIG_FILE_VARIABLE_CLASS_PATH = "VarAnnoConfig.classPathToConfig";

    // ----------------------------------------------------------
    // Allele Options:
    // ----------------------------------------------------------

    /**
     * Alleles longer than this are replaced by their {@code <N>_base_deletion} form in allele strings.
     */
    @Key("allele.symbolic_deletion_threshold")
    @DefaultValue("4000")
    int symbolicDeletionThreshold();

    /**
     * Alleles longer than this are stored in their {@code <N>_base_deletion} form in per-allele records.
     */
    @Key("allele.stored_max_length")
    @DefaultValue("100")
    int storedAlleleMaxLength();

    // ----------------------------------------------------------
    // Engine Options:
    // ----------------------------------------------------------

    @Key("engine.threads")
    @DefaultValue("4")
    int engineThreads();
}
