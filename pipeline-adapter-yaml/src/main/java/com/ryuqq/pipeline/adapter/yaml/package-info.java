/**
 * YAML 정의 문서 어댑터.
 *
 * <p>Jackson YAML로 문서를 읽어 {@link com.ryuqq.pipeline.core.definition.PipelineDefinition}을
 * 만듭니다. 템플릿 병합과 그래프 검증은 core 모듈이 담당합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.adapter.yaml;
