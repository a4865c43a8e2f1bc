package com.pie.scheduler.output;

/**
 * How a {@link CleanupRule} cuts its marker out of engine output. Cuts only happen where the engine
 * frames a task's answer, never inside it.
 */
public enum StripStrategy {
    /** Keep the text after the first occurrence that starts a line ("Completed:" prefix). */
    KEEP_AFTER,
    /** Keep the text before the first occurrence that starts a line (shutdown and restart banners). */
    KEEP_BEFORE,
    /** Delete every occurrence (end-of-turn tokens). */
    REMOVE,
    /** Delete the leading lines that contain the marker (launch banner). */
    DROP_LEADING_LINES
}
