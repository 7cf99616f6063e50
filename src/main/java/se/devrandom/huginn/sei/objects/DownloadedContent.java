/*
 * Huginn - SEI Process Synchronization
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
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
package se.devrandom.huginn.sei.objects;

import java.util.Locale;

/**
 * Binary document content with what the response headers said about it.
 */
public record DownloadedContent(byte[] content, String filename, String contentType) {

    private static final String DEFAULT_EXTENSION = "pdf";

    /**
     * File extension from the Content-Disposition filename, then the Content-Type, then "pdf".
     */
    public String fileExtension() {
        if (filename != null) {
            int dot = filename.lastIndexOf('.');
            if (dot >= 0 && dot < filename.length() - 1) {
                return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
            }
        }
        if (contentType != null) {
            String mime = contentType.toLowerCase(Locale.ROOT);
            int semicolon = mime.indexOf(';');
            if (semicolon >= 0) {
                mime = mime.substring(0, semicolon).trim();
            }
            return switch (mime) {
                case "application/pdf" -> "pdf";
                case "text/html" -> "html";
                case "text/plain" -> "txt";
                case "image/jpeg" -> "jpg";
                case "image/png" -> "png";
                case "application/msword" -> "doc";
                case "application/vnd.openxmlformats-officedocument.wordprocessingml.document" -> "docx";
                case "application/vnd.ms-excel" -> "xls";
                case "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet" -> "xlsx";
                case "application/zip" -> "zip";
                default -> DEFAULT_EXTENSION;
            };
        }
        return DEFAULT_EXTENSION;
    }

    public int size() {
        return content.length;
    }
}
