/**
 * 명령행 런처.
 *
 * <p><strong>명령:</strong></p>
 * <ul>
 *   <li>{@code pipeline plan} - 정의를 로드하고 ref/source/변수에 대해 만들어지는 Job 그래프를 출력</li>
 *   <li>{@code pipeline run} - 그래프를 로컬 셸에서 실행하고 결과를 종료 코드로 반환</li>
 * </ul>
 *
 * <p>종료 코드: 0 성공, 1 실패, 2 취소, 3 정의/그래프/명령행 오류.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.pipeline.cli;
