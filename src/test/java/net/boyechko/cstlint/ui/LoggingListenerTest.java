/*
 * CST-Lint - Lint Engine over a Lossless Concrete Syntax Tree
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.cstlint.ui;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import java.util.stream.Collectors;
import net.boyechko.cstlint.core.ProcessingService;
import net.boyechko.cstlint.core.SourceFile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingListenerTest {
    private Logger processingLogger;
    private Level previousLevel;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void captureLogs() {
        processingLogger = (Logger) LoggerFactory.getLogger("net.boyechko.cstlint.processing");
        previousLevel = processingLogger.getLevel();
        processingLogger.setLevel(Level.INFO);
        appender = new ListAppender<>();
        appender.start();
        processingLogger.addAppender(appender);
    }

    @AfterEach
    void releaseLogs() {
        processingLogger.detachAppender(appender);
        processingLogger.setLevel(previousLevel);
    }

    private List<String> messages() {
        return appender.list.stream()
                .map(ILoggingEvent::getFormattedMessage)
                .collect(Collectors.toList());
    }

    @Test
    void logsViolationsFixesAndSummary() {
        ProcessingService service =
                ProcessingService.builder()
                        .withListener(new LoggingListener(true))
                        .withAutofix(true)
                        .build();

        service.process(SourceFile.of("a.py", "class C(object):\n    pass\n"));

        List<String> messages = messages();
        assertTrue(
                messages.contains(
                        "a.py:1:8 NoInheritFromObject Class C inherits from object explicitly"),
                messages.toString());
        assertTrue(messages.stream().anyMatch(m -> m.startsWith("FIXED a.py NoInheritFromObject")));
        assertTrue(messages.stream().anyMatch(m -> m.contains("+class C:")));
        assertTrue(messages.contains("SUMMARY a.py CHECKED detected=1 resolved=1 remaining=0"));
    }

    @Test
    void logsUnparseableFiles() {
        ProcessingService service =
                ProcessingService.builder().withListener(new LoggingListener()).build();

        service.process(SourceFile.of("broken.py", "x = class\n"));

        assertTrue(
                messages().stream().anyMatch(m -> m.startsWith("UNPARSEABLE broken.py:1:4")),
                messages().toString());
        assertEquals(
                Level.WARN,
                appender.list.stream()
                        .filter(e -> e.getFormattedMessage().startsWith("UNPARSEABLE"))
                        .findFirst()
                        .orElseThrow()
                        .getLevel());
    }
}
