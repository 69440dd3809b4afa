/**
 * Cycle orchestration: fan-out of metric fetches, deadline handling,
 * tracking, correlation and report fan-out.
 */
package com.changesentinel.core.orchestration;
