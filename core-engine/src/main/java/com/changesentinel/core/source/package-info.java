/**
 * Seams to the outside world: metric samples and deployment events.
 */
package com.changesentinel.core.source;
