/**
 * Job DAG 빌드.
 *
 * <p>rules 평가, stage 대기와 needs의 단일 간선 모델, 순환 검사, 위상 정렬을 담당합니다.
 * 그래프 표현과 순환 검사는 JGraphT를 사용합니다.</p>
 */
package com.ryuqq.pipeline.core.graph;
