/**
 * Log-based run reporting attached to the scheduler through
 * {@link com.pie.scheduler.listener.SchedulerListener}.
 */
package com.pie.report;
