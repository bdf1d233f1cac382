package io.incrementaltests.core.recording;

import io.incrementaltests.core.model.Fingerprint;
import io.incrementaltests.core.model.FingerprintEntry;
import io.incrementaltests.core.model.NodeId;
import io.incrementaltests.core.stability.ChecksumCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link Tracer} that turns the files reported by a {@link CoverageCollector}
 * into a fingerprint, pinning each file to its current checksum. Files without a
 * checksum (deleted, unreadable) are left out. The library signature is always
 * part of the fingerprint.
 */
public final class FingerprintTracer implements Tracer {

    private static final Logger log = LoggerFactory.getLogger(FingerprintTracer.class);

    private final CoverageCollector collector;
    private final ChecksumCalculator checksums;
    private TraceHandle active;

    public FingerprintTracer(CoverageCollector collector, ChecksumCalculator checksums) {
        this.collector = collector;
        this.checksums = checksums;
    }

    @Override
    public TraceHandle begin(NodeId node) {
        if (active != null) {
            log.warn("Trace of {} was never ended; discarding it.", active.node());
            discard(active);
        }
        collector.start();
        active = new TraceHandle(node, System.nanoTime());
        return active;
    }

    @Override
    public Fingerprint end(TraceHandle handle) {
        requireActive(handle);
        active = null;
        Set<String> touched = new TreeSet<>(collector.stop());

        List<FingerprintEntry> entries = new ArrayList<>();
        for (String file : touched) {
            Optional<String> checksum = checksums.checksum(file);
            if (checksum.isPresent()) {
                entries.add(new FingerprintEntry(file, checksum.get()));
            } else {
                log.debug("  No checksum for touched file {}; leaving it out", file);
            }
        }
        entries.add(new FingerprintEntry(ChecksumCalculator.LIBRARIES, checksums.librariesChecksum()));
        return Fingerprint.of(entries);
    }

    @Override
    public void discard(TraceHandle handle) {
        if (active != null && active.equals(handle)) {
            active = null;
            collector.stop();
        }
    }

    @Override
    public void close() {
        collector.close();
    }

    private void requireActive(TraceHandle handle) {
        if (active == null || !active.equals(handle)) {
            throw new IllegalStateException("No active trace for " + handle.node());
        }
    }
}
