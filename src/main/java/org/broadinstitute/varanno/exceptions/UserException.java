package org.broadinstitute.varanno.exceptions;

import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to caller mistakes, such as non-existent reference files
 * or unusable configuration values.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final Path file, final String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotReadInputFile(final Path file, final String message, final Exception e) {
            super(String.format("Couldn't read file %s. Error was: %s with exception: %s", file.toAbsolutePath().toUri(), message, getMessage(e)), e);
        }
    }

    public static class MissingReferenceFaiFile extends UserException {
        private static final long serialVersionUID = 0L;

        public MissingReferenceFaiFile(final Path indexPath, final Path fastaPath) {
            super(String.format("Fasta index file %s for reference %s does not exist. Please index the reference with 'samtools faidx'.",
                    indexPath.toAbsolutePath().toUri(), fastaPath.toAbsolutePath().toUri()));
        }
    }

    public static class BadConfiguration extends UserException {
        private static final long serialVersionUID = 0L;

        public BadConfiguration(final String key, final Object value, final String message) {
            super(String.format("Configuration value %s=%s is not usable: %s", key, value, message));
        }
    }
}
