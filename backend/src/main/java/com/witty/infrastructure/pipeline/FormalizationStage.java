package com.witty.infrastructure.pipeline;

import com.witty.domain.formalize.model.StageId;
import com.witty.domain.formalize.model.StageResult;

/**
 * One pipeline stage. Deterministic and adapter-assisted variants of the same stage share this interface
 * and are chosen by configuration when the pipeline is built.
 *
 * @param <I> validated payload of the previous stage
 * @param <O> payload this stage produces
 */
public interface FormalizationStage<I, O> {

    StageId stageId();

    StageResult<O> execute(I input, FormalizationContext context);
}
