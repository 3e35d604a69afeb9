/**
 * In-memory circuit breaker state machine and preset factories.
 */
package com.ryuqq.circuitbreaker.adapter.inmemory.breaker;
