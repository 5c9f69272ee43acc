package org.broadinstitute.varanno.utils.reference;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.SAMSequenceRecord;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.reference.ReferenceSequenceFile;
import htsjdk.samtools.reference.ReferenceSequenceFileFactory;
import htsjdk.samtools.util.StringUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varanno.exceptions.UserException;
import org.broadinstitute.varanno.exceptions.VarAnnoException;
import org.broadinstitute.varanno.utils.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link SequenceProvider} backed by an indexed FASTA file.
 *
 * Bases are returned exactly as stored (soft-masked lower case is preserved); comparisons downstream are
 * case-insensitive.  Reads are serialized on the underlying file, so one instance can be shared by workers.
 *
 * Instances of this class should be closed when they are no longer needed.
 */
public final class ReferenceFileSequenceProvider implements SequenceProvider, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ReferenceFileSequenceProvider.class);

    private final Path fastaPath;
    private final ReferenceSequenceFile sequenceFile;

    /**
     * Open an indexed FASTA file.  The {@code .fai} index must sit next to the FASTA file.
     * @param fastaPath path to the FASTA file.  Must not be {@code null}.
     */
    public ReferenceFileSequenceProvider(final Path fastaPath) {
        this.fastaPath = Utils.nonNull(fastaPath, "fastaPath");

        if ( !Files.exists(fastaPath) ) {
            throw new UserException.CouldNotReadInputFile(fastaPath, "the reference file does not exist");
        }
        final Path indexPath = fastaPath.resolveSibling(fastaPath.getFileName() + ".fai");
        if ( !Files.exists(indexPath) ) {
            throw new UserException.MissingReferenceFaiFile(indexPath, fastaPath);
        }

        try {
            sequenceFile = ReferenceSequenceFileFactory.getReferenceSequenceFile(fastaPath, true, true);
        }
        catch (final SAMException e) {
            throw new UserException.CouldNotReadInputFile(fastaPath, "could not open the indexed reference", e);
        }
        logger.debug("Opened reference " + fastaPath);
    }

    @Override
    public String fetch(final String region, final int start, final int end) {
        Utils.nonNull(region, "region");
        if ( start < 1 || end < start ) {
            throw new VarAnnoException.SequenceUnavailable(region, start, end);
        }

        synchronized (sequenceFile) {
            final SAMSequenceRecord record = sequenceFile.getSequenceDictionary() == null
                    ? null
                    : sequenceFile.getSequenceDictionary().getSequence(region);
            if ( record != null && end > record.getSequenceLength() ) {
                throw new VarAnnoException.SequenceUnavailable(region, start, end);
            }

            try {
                final ReferenceSequence sequence = sequenceFile.getSubsequenceAt(region, start, end);
                return StringUtil.bytesToString(sequence.getBases());
            }
            catch (final SAMException e) {
                throw new VarAnnoException.SequenceUnavailable(region, start, end, e);
            }
        }
    }

    @Override
    public void close() {
        try {
            sequenceFile.close();
        }
        catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(fastaPath, "error while closing the reference", e);
        }
    }
}
