// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.ferrite.core.LogSanitizer;

/**
 * {@link NoticeListener} that writes notices to SLF4J.
 *
 * <p>Call traces are logged at DEBUG, failed calls at WARN and adapter information at
 * INFO. Credentials of {@code AUTH} commands are masked and long traces truncated.
 */
public final class Slf4jNoticeListener implements NoticeListener {

    private final Logger logger;

    public Slf4jNoticeListener() {
        this(LoggerFactory.getLogger(Slf4jNoticeListener.class));
    }

    public Slf4jNoticeListener(final Logger logger) {
        this.logger = logger;
    }

    @Override
    public void onNotice(final Notice notice) {
        if (notice.type() == NoticeType.INFO) {
            if (logger.isInfoEnabled()) {
                logger.info("[notice] {}", LogSanitizer.sanitize(notice.log()));
            }
        } else if (notice.exception() != null) {
            if (logger.isWarnEnabled()) {
                logger.warn("[call] {}", LogSanitizer.sanitize(notice.log()));
            }
        } else if (logger.isDebugEnabled()) {
            logger.debug("[call] {}", LogSanitizer.sanitize(notice.log()));
        }
    }
}
