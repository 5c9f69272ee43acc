package org.broadinstitute.varanno.exceptions;

import org.broadinstitute.varanno.utils.SimpleInterval;

/**
 * <p/>
 * Class VarAnnoException.
 * <p/>
 * Root of the failures raised while annotating a single variant.  None of these are meant to stop a batch:
 * callers catch them per variant (or per allele) and record them next to the results that did succeed.
 */
public class VarAnnoException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public VarAnnoException( final String msg ) {
        super(msg);
    }

    public VarAnnoException( final String message, final Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of VarAnnoException for common kinds of errors
     */

    /**
     * <p/>
     * A position or span could not be resolved against its coordinate system.
     */
    public static class CoordinateException extends VarAnnoException {
        private static final long serialVersionUID = 0L;

        public CoordinateException( final String s ) {
            super(s);
        }

        public CoordinateException( final String s, final Throwable throwable ) {
            super(s, throwable);
        }
    }

    /**
     * <p/>
     * The sequence provider could not return bases for a requested span.
     */
    public static class SequenceUnavailable extends CoordinateException {
        private static final long serialVersionUID = 0L;

        public SequenceUnavailable( final String region, final int start, final int end ) {
            super(String.format("Sequence is not available for %s:%d-%d", region, start, end));
        }

        public SequenceUnavailable( final String region, final int start, final int end, final Throwable throwable ) {
            super(String.format("Sequence is not available for %s:%d-%d", region, start, end), throwable);
        }
    }

    /**
     * <p/>
     * A genomic position lies upstream or downstream of every exon of a transcript.
     */
    public static class OutOfTranscriptBounds extends CoordinateException {
        private static final long serialVersionUID = 0L;

        public OutOfTranscriptBounds( final int position, final SimpleInterval transcriptSpan ) {
            super(String.format("Position %d is outside of the transcript span %s", position, transcriptSpan));
        }
    }

    public static class UnsupportedReferenceFrame extends VarAnnoException {
        private static final long serialVersionUID = 0L;

        public UnsupportedReferenceFrame( final String frame, final String featureName ) {
            super(String.format("HGVS %s notation is not available for %s", frame, featureName));
        }
    }

    /**
     * <p/>
     * Allele text that contains something other than nucleotides where clean nucleotide text is required.
     */
    public static class MalformedAllele extends VarAnnoException {
        private static final long serialVersionUID = 0L;

        public MalformedAllele( final String allele, final String reason ) {
            super(String.format("Malformed allele \"%s\": %s", allele, reason));
        }
    }
}
