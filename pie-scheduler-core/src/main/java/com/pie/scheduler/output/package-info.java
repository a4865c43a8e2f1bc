/**
 * Rule-based cleanup of engine output.
 */
package com.pie.scheduler.output;
