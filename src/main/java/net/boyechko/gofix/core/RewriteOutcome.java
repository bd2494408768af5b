/*
 * GoFix - Automated Go Source Migration
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
package net.boyechko.gofix.core;

import java.util.List;

/**
 * What happened to one source file. {@code changed} is always exactly {@code
 * !newText.equals(originalText)}; a failed file keeps its original text.
 *
 * @param error the per-file failure, or {@code null}: a {@link
 *     net.boyechko.gofix.syntax.ParseException}, a {@link RewriteException} or an {@link
 *     java.io.IOException}
 */
public record RewriteOutcome(
        String path,
        String originalText,
        String newText,
        List<String> appliedFixNames,
        boolean changed,
        Exception error) {

    public RewriteOutcome {
        appliedFixNames = List.copyOf(appliedFixNames);
    }

    public static RewriteOutcome success(
            String path, String originalText, String newText, List<String> appliedFixNames) {
        return new RewriteOutcome(
                path,
                originalText,
                newText,
                appliedFixNames,
                !newText.equals(originalText),
                null);
    }

    public static RewriteOutcome failure(String path, String originalText, Exception error) {
        return new RewriteOutcome(path, originalText, originalText, List.of(), false, error);
    }

    /** The same outcome with a failure that happened afterwards, such as a failed write. */
    public RewriteOutcome withError(Exception error) {
        return new RewriteOutcome(path, originalText, newText, appliedFixNames, changed, error);
    }

    public boolean isFailure() {
        return error != null;
    }

    /** The error message, or an empty string. */
    public String errorMessage() {
        if (error == null) {
            return "";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
