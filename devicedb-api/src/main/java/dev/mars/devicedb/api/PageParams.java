/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.devicedb.api;

import java.util.regex.Pattern;

/**
 * Paging request for list queries. Page indexes start at 1.
 *
 * @param pageIndex 1-based page number
 * @param pageSize  rows per page
 * @param orderBy   column to sort by, or {@code null}/empty for the natural order
 * @param ascending sort direction
 */
public record PageParams(
    int pageIndex,
    int pageSize,
    String orderBy,
    boolean ascending
) {
    public static final int DEFAULT_PAGE_SIZE = 20;

    private static final Pattern COLUMN_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public PageParams {
        if (pageIndex < 1) {
            throw new IllegalArgumentException("Page index must be at least 1: " + pageIndex);
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be at least 1: " + pageSize);
        }
        if (orderBy != null && !orderBy.isEmpty() && !COLUMN_NAME.matcher(orderBy).matches()) {
            throw new IllegalArgumentException("Invalid order by column: " + orderBy);
        }
    }

    public static PageParams of(int pageIndex, int pageSize) {
        return new PageParams(pageIndex, pageSize, null, true);
    }

    public static PageParams firstPage() {
        return of(1, DEFAULT_PAGE_SIZE);
    }

    public PageParams orderedBy(String column, boolean ascending) {
        return new PageParams(pageIndex, pageSize, column, ascending);
    }

    public int offset() {
        return (pageIndex - 1) * pageSize;
    }

    /**
     * Returns the SQL {@code ORDER BY} clause for this request, or an empty string
     * when no column was requested.
     */
    public String orderByClause() {
        if (orderBy == null || orderBy.isEmpty()) {
            return "";
        }
        return " ORDER BY " + orderBy + (ascending ? " ASC" : " DESC");
    }
}
