/**
 * 예상된 오류(expected error) 분류 지원.
 *
 * <p>HTTP 상태 코드와 오류 코드를 노출하는 캐리어 인터페이스, 그리고 원인 체인을
 * 따라가며 판별하는 {@link com.ryuqq.circuitbreaker.core.error.ExpectedErrors} 술어 모음.</p>
 */
package com.ryuqq.circuitbreaker.core.error;
