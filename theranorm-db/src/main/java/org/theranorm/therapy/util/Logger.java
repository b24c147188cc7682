package org.theranorm.therapy.util;

/*
 * This file is part of TheraNorm.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * TheraNorm is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * TheraNorm is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with TheraNorm.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Small static logger shared by the loaders, the index writer and the backfill
 * job.
 *
 * <p>Configuration via system properties:</p>
 * <ul>
 *   <li><b>theranorm.log.level</b> – minimum level to print (default: INFO)</li>
 *   <li><b>theranorm.log.datetime</b> – timestamp pattern (default: yyyy-MM-dd HH:mm:ss)</li>
 * </ul>
 *
 * <p>Messages use {@code {}} placeholders. INFO and below go to stdout,
 * WARN/ERROR to stderr.</p>
 */
public final class Logger {

    /** Log levels in increasing order of severity. */
    public enum Level {
        TRACE, DEBUG, INFO, WARN, ERROR;

        static Level parse(String s, Level fallback) {
            if (s == null) return fallback;
            try {
                return Level.valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                return fallback;
            }
        }
    }

    public static final String SYS_PROP_LEVEL = "theranorm.log.level";
    public static final String SYS_PROP_DATETIME = "theranorm.log.datetime";

    private static final Level MIN_LEVEL =
            Level.parse(System.getProperty(SYS_PROP_LEVEL), Level.INFO);

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern(System.getProperty(SYS_PROP_DATETIME, "yyyy-MM-dd HH:mm:ss"));

    private Logger() {}

    /** Alias for {@link #info(String, Object...)}. */
    public static void log(String text) {
        info(text);
    }

    public static boolean isEnabled(Level level) {
        return level.ordinal() >= MIN_LEVEL.ordinal();
    }

    public static void trace(String msg, Object... args) { write(Level.TRACE, null, msg, args); }
    public static void debug(String msg, Object... args) { write(Level.DEBUG, null, msg, args); }
    public static void info (String msg, Object... args) { write(Level.INFO , null, msg, args); }
    public static void warn (String msg, Object... args) { write(Level.WARN , null, msg, args); }
    public static void error(String msg, Object... args) { write(Level.ERROR, null, msg, args); }

    public static void warn (String msg, Throwable t, Object... args) { write(Level.WARN , t, msg, args); }
    public static void error(String msg, Throwable t, Object... args) { write(Level.ERROR, t, msg, args); }

    private static void write(Level level, Throwable t, String msg, Object... args) {
        if (!isEnabled(level)) return;

        final String line = "[" + LocalDateTime.now().format(TS) + "] ["
                + Thread.currentThread().getName() + "] " + level + " " + format(msg, args);
        final PrintStream out = (level.ordinal() >= Level.WARN.ordinal()) ? System.err : System.out;

        synchronized (Logger.class) {
            out.println(line);
            if (t != null) {
                t.printStackTrace(out);
            }
        }
    }

    /**
     * Replaces each "{}" with the next argument; surplus arguments are appended
     * separated by spaces.
     */
    static String format(String template, Object... args) {
        if (template == null) return "null";
        if (args == null || args.length == 0) return template;

        StringBuilder sb = new StringBuilder(template.length() + args.length * 8);
        int next = 0;
        int from = 0;
        int at;
        while (next < args.length && (at = template.indexOf("{}", from)) >= 0) {
            sb.append(template, from, at).append(args[next++]);
            from = at + 2;
        }
        sb.append(template, from, template.length());
        while (next < args.length) {
            sb.append(' ').append(args[next++]);
        }
        return sb.toString();
    }
}
