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

import java.util.List;

/**
 * One page of a list query together with the paging totals.
 */
public record PageResult<T>(
    List<T> data,
    long totalCount,
    int totalPages,
    int currentPage,
    int pageSize
) {
    public PageResult {
        data = List.copyOf(data);
    }

    public static <T> PageResult<T> of(List<T> data, long totalCount, PageParams params) {
        int totalPages = (int) ((totalCount + params.pageSize() - 1) / params.pageSize());
        return new PageResult<>(data, totalCount, totalPages, params.pageIndex(), params.pageSize());
    }

    public boolean hasNext() {
        return currentPage < totalPages;
    }

    public boolean hasPrevious() {
        return currentPage > 1;
    }
}
