package com.entrainment.validation.logger;

import com.entrainment.common.model.ValidationResult;
import com.entrainment.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs the stages a request passes through on its way to a verdict. Pure side-effects;
 * never alters the pipeline.
 *
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}   request body decoded by the controller</li>
 *   <li>{@link #ENGINE_COMPLETED}   engine call returned</li>
 *   <li>{@link #VERDICT_READY}      validation verdict assembled for the response</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(ValidationFlowLogger.ENGINE_COMPLETED))
 * </pre>
 */
@Component
public class ValidationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(ValidationFlowLogger.class);

    public static final String REQUEST_RECEIVED = "REQUEST_RECEIVED";
    public static final String ENGINE_COMPLETED = "ENGINE_COMPLETED";
    public static final String VERDICT_READY    = "VERDICT_READY";

    /** {@code doOnEach} consumer; fires on {@code onNext} only, trace id read from the Reactor Context. */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[ValidationFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String endpoint, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[ValidationFlow] stage={} endpoint={} traceId={}", stageName, endpoint, traceId)
        );
    }

    /** {@code doOnEach} consumer that summarizes a validation verdict. */
    public Consumer<Signal<ValidationResult>> verdict() {
        return signal -> {
            if (!signal.isOnNext() || signal.get() == null) return;
            ValidationResult result = signal.get();
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[ValidationFlow] stage={} valid={} safe={} score={} critical={} errors={} warnings={} traceId={}",
                    VERDICT_READY, result.isValid(), result.isSafe(), result.overallScore(),
                    result.criticalIssues().size(), result.errors().size(), result.warnings().size(), traceId)
            );
        };
    }
}
