package in.fxledger.service.job;

import in.fxledger.domain.job.CrawlResult;
import in.fxledger.domain.job.Job;
import in.fxledger.domain.job.JobListener;
import in.fxledger.domain.job.JobOptions;
import in.fxledger.domain.model.ImportMode;
import in.fxledger.domain.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Publishes an import job when a crawl job with {@code autoImport=true} succeeds.
 *
 * Fire-and-forget: a failure to enqueue is logged and never fails the crawl.
 */
public final class ImportChainer implements JobListener {
    private static final Logger log = LoggerFactory.getLogger(ImportChainer.class);

    private final QueueRegistry queues;

    public ImportChainer(QueueRegistry queues) {
        this.queues = queues;
    }

    @Override
    public void onCompleted(Job job, Object result) {
        if (!job.options().getBoolean(JobOptions.AUTO_IMPORT)) {
            return;
        }
        Optional<SourceKind> source = SourceKind.fromQueue(job.queue());
        if (source.isEmpty() || !source.get().isCrawlQueue(job.queue())) {
            return;
        }
        if (!(result instanceof CrawlResult)) {
            log.warn("[{}] Job {} completed without a crawl result, no import chained", job.queue(), job.id());
            return;
        }
        CrawlResult crawl = (CrawlResult) result;
        JobOptions importOptions = JobOptions.empty()
            .with(JobOptions.MODE, ImportMode.LATEST.name().toLowerCase(Locale.ROOT))
            .with(JobOptions.IDENTIFIER, crawl.identifier());
        String importJobId = JobIds.chainedImport(job.id());
        try {
            if (queues.importQueue(source.get()).add(importJobId, importOptions)) {
                log.info("[{}] Chained import job {}", job.queue(), importJobId);
            }
        } catch (RuntimeException e) {
            log.error("[{}] Failed to chain import for job {}: {}", job.queue(), job.id(), e.getMessage(), e);
        }
    }
}
