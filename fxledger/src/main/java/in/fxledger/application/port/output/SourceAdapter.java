package in.fxledger.application.port.output;

import in.fxledger.domain.job.JobOptions;
import in.fxledger.domain.model.CapturedSnapshot;
import in.fxledger.domain.model.SourceKind;

/**
 * Fetches one raw payload from an upstream provider.
 */
public interface SourceAdapter {

    SourceKind kind();

    /**
     * @param options crawl job options (symbol, currency pair, interval...)
     * @throws in.fxledger.domain.common.FetchException when the provider cannot be reached
     */
    CapturedSnapshot fetch(JobOptions options);
}
