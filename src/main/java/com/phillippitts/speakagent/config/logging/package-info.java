/**
 * Logging support: the servlet filter that seeds the Log4j2 ThreadContext per request.
 */
package com.phillippitts.speakagent.config.logging;
