package io.malicki.transferpipeline.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse<T> {

    private List<T> items;
    private Pagination pagination;

    /**
     * @param page one-based page number echoed back to the client
     */
    public static <S, T> PageResponse<T> of(Page<S> source, int page, Function<S, T> mapper) {
        Pagination pagination = new Pagination(
            page,
            source.getSize(),
            source.getTotalElements(),
            source.getTotalPages(),
            source.hasNext(),
            source.hasPrevious()
        );
        return new PageResponse<>(source.getContent().stream().map(mapper).collect(Collectors.toList()), pagination);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Pagination {
        private int page;
        private int limit;
        private long total;
        private int totalPages;
        private boolean hasNext;
        private boolean hasPrev;
    }
}
