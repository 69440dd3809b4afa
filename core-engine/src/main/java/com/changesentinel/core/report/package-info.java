/**
 * Report retention and fan-out.
 */
package com.changesentinel.core.report;
