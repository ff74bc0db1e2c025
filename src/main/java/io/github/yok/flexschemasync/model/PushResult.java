package io.github.yok.flexschemasync.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Everything a push run produced. Fields of stages that were not reached are {@code null}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@Builder
@ToString
public class PushResult {

    private final PushStatus status;

    private final ReconciliationResult reconciliation;

    private final LoadReport loadReport;

    private final PushScript script;

    private final ApplyResult applyResult;

    /**
     * Creates the result of a run stopped by a fatal error.
     *
     * @return aborted result
     */
    public static PushResult aborted() {
        return PushResult.builder().status(PushStatus.ABORTED).build();
    }
}
