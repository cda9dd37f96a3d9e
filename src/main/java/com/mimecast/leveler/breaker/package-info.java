/**
 * Per queue circuit breakers.
 */
package com.mimecast.leveler.breaker;
