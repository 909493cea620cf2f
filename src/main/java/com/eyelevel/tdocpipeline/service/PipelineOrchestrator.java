package com.eyelevel.tdocpipeline.service;

import com.eyelevel.tdocpipeline.config.PipelineProperties;
import com.eyelevel.tdocpipeline.exception.FatalSetupException;
import com.eyelevel.tdocpipeline.exception.ManifestException;
import com.eyelevel.tdocpipeline.model.ConversionUnit;
import com.eyelevel.tdocpipeline.model.DownloadRecord;
import com.eyelevel.tdocpipeline.model.ExtractionRecord;
import com.eyelevel.tdocpipeline.model.PipelineReport;
import com.eyelevel.tdocpipeline.model.PipelineStage;
import com.eyelevel.tdocpipeline.model.PipelineState;
import com.eyelevel.tdocpipeline.model.StageItem;
import com.eyelevel.tdocpipeline.model.StageOutcome;
import com.eyelevel.tdocpipeline.model.StageSummary;
import com.eyelevel.tdocpipeline.service.download.DownloadWorker;
import com.eyelevel.tdocpipeline.service.extract.ExtractionWorker;
import com.eyelevel.tdocpipeline.service.manifest.ManifestFetcher;
import com.eyelevel.tdocpipeline.service.render.ConversionWorker;
import com.eyelevel.tdocpipeline.storage.ArtifactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sequences one run of the pipeline: fetch the manifest, then download, extract and convert.
 * <p>
 * Stages run strictly one after another; only the items inside a stage run concurrently. An
 * item whose stage failed is never handed to the next stage. Only a {@link FatalSetupException}
 * (storage layout or manifest) aborts the run; every other failure stays scoped to its item.
 * <p>
 * The filesystem below the storage root is the only record of progress, so a run can be
 * repeated after any crash. Running two orchestrators against the same root at the same time
 * is not supported and not detected.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

    private final PipelineProperties properties;
    private final ArtifactStore artifactStore;
    private final ManifestFetcher manifestFetcher;
    private final StageExecutor stageExecutor;
    private final ResultAggregator resultAggregator;
    private final DownloadWorker downloadWorker;
    private final ExtractionWorker extractionWorker;
    private final ConversionWorker conversionWorker;

    private final AtomicReference<PipelineState> state = new AtomicReference<>(PipelineState.IDLE);

    public PipelineState getState() {
        return state.get();
    }

    /**
     * Executes a complete run.
     *
     * @return the report of the finished run
     * @throws FatalSetupException if the storage layout cannot be created, the manifest cannot be
     *                             fetched, or the manifest is empty while that is configured as fatal
     */
    public PipelineReport run() {
        List<String> identifiers = fetchManifest();
        if (identifiers.isEmpty()) {
            return report(0, 0, StageSummary.empty(PipelineStage.DOWNLOAD),
                    StageSummary.empty(PipelineStage.EXTRACT), StageSummary.empty(PipelineStage.CONVERT));
        }

        transition(PipelineState.DOWNLOAD_STAGE);
        List<DownloadRecord> downloads = identifiers.stream().map(this::downloadRecord).toList();
        List<StageOutcome<DownloadRecord>> downloadOutcomes = stageExecutor.execute(PipelineStage.DOWNLOAD,
                downloads, downloadWorker, properties.getDownload().getWorkers());
        StageSummary downloadSummary = resultAggregator.summarize(PipelineStage.DOWNLOAD, downloadOutcomes);

        transition(PipelineState.EXTRACT_STAGE);
        List<ExtractionRecord> extractions = survivors(downloadOutcomes).stream()
                .map(download -> new ExtractionRecord(download.artifactId(), download.localPath(),
                        artifactStore.extractionDirectory(download.artifactId())))
                .toList();
        List<StageOutcome<ExtractionRecord>> extractOutcomes = stageExecutor.execute(PipelineStage.EXTRACT,
                extractions, extractionWorker, properties.getExtract().getWorkers());
        StageSummary extractSummary = resultAggregator.summarize(PipelineStage.EXTRACT, extractOutcomes);

        transition(PipelineState.CONVERT_STAGE);
        List<ConversionUnit> units = conversionUnits(survivors(extractOutcomes));
        List<StageOutcome<ConversionUnit>> convertOutcomes = stageExecutor.execute(PipelineStage.CONVERT,
                units, conversionWorker, properties.getConvert().getWorkers());
        StageSummary convertSummary = resultAggregator.summarize(PipelineStage.CONVERT, convertOutcomes);

        return report(identifiers.size(), units.size(), downloadSummary, extractSummary, convertSummary);
    }

    private List<String> fetchManifest() {
        transition(PipelineState.FETCHING);
        try {
            artifactStore.ensureLayout();
            URI source = properties.sourceUri();
            List<String> identifiers = manifestFetcher.fetch(source);
            if (identifiers.isEmpty()) {
                if (properties.isFailOnEmptyManifest()) {
                    throw new ManifestException("No archives found at " + source);
                }
                log.warn("No archives found at {}. Nothing to do.", source);
            }
            return identifiers;
        } catch (FatalSetupException e) {
            transition(PipelineState.FATAL_ABORT);
            log.error("Pipeline aborted during setup: {}", e.getMessage());
            throw e;
        } catch (IllegalArgumentException e) {
            transition(PipelineState.FATAL_ABORT);
            throw new FatalSetupException("Invalid source URL: " + properties.getSourceUrl(), e);
        }
    }

    private DownloadRecord downloadRecord(String artifactId) {
        URI remote = properties.sourceUri().resolve(artifactStore.archiveFileName(artifactId));
        return new DownloadRecord(artifactId, remote, artifactStore.downloadPath(artifactId));
    }

    private <T extends StageItem> List<T> survivors(List<StageOutcome<T>> outcomes) {
        return outcomes.stream().filter(outcome -> !outcome.isFailed()).map(StageOutcome::item).toList();
    }

    /**
     * Enumerates the documents of every usable extraction. Two documents of one archive that map
     * onto the same output paths (same base name, different extension) keep the first one.
     */
    private List<ConversionUnit> conversionUnits(List<ExtractionRecord> extractions) {
        List<ConversionUnit> units = new ArrayList<>();
        Set<Path> claimedOutputs = new HashSet<>();
        for (ExtractionRecord extraction : extractions) {
            String artifactId = extraction.artifactId();
            for (Path document : artifactStore.listDocuments(artifactId)) {
                Path richLayout = artifactStore.richLayoutPath(artifactId, document);
                if (!claimedOutputs.add(richLayout)) {
                    log.warn("[{}] Skipping {}: another document already produces {}.",
                            artifactId, extraction.destinationDirectory().relativize(document), richLayout.getFileName());
                    continue;
                }
                units.add(new ConversionUnit(artifactId, document, richLayout,
                        artifactStore.structuredTextPath(artifactId, document)));
            }
        }
        log.info("Found {} document(s) to convert in {} extraction(s).", units.size(), extractions.size());
        return units;
    }

    private PipelineReport report(int manifestSize, int documentCount, StageSummary download,
                                  StageSummary extract, StageSummary convert) {
        transition(PipelineState.DONE);
        PipelineReport report = PipelineReport.builder()
                .state(PipelineState.DONE)
                .manifestSize(manifestSize)
                .documentCount(documentCount)
                .download(download)
                .extract(extract)
                .convert(convert)
                .downloadDirectory(artifactStore.downloadDirectory())
                .extractDirectory(artifactStore.extractDirectory())
                .richLayoutDirectory(artifactStore.richLayoutDirectory())
                .structuredTextDirectory(artifactStore.structuredTextDirectory())
                .build();
        logSummary(report);
        return report;
    }

    private void logSummary(PipelineReport report) {
        log.info("==================================================================");
        log.info("PROCESSING SUMMARY");
        log.info("==================================================================");
        log.info("Archives in manifest: {}", report.getManifestSize());
        logStage("Downloads", report.getDownload());
        logStage("Extractions", report.getExtract());
        log.info("Documents found:      {}", report.getDocumentCount());
        logStage("Conversions", report.getConvert());
        log.info("Output locations:");
        log.info("  - ZIP files:  {}", report.getDownloadDirectory());
        log.info("  - Extracted:  {}", report.getExtractDirectory());
        log.info("  - HTML:       {}", report.getRichLayoutDirectory());
        log.info("  - Markdown:   {}", report.getStructuredTextDirectory());
        log.info("==================================================================");
    }

    private void logStage(String label, StageSummary summary) {
        log.info("{}: {} succeeded, {} skipped, {} failed (of {})", String.format("%-21s", label),
                summary.succeeded(), summary.skipped(), summary.failed(), summary.total());
    }

    private void transition(PipelineState next) {
        PipelineState previous = state.getAndSet(next);
        log.debug("Pipeline state {} -> {}", previous, next);
    }
}
