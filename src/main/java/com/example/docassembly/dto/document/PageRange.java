package com.example.docassembly.dto.document;

import lombok.Value;

@Value
public class PageRange {
    int start;
    int end;

    public static PageRange single(int pageIndex) {
        return new PageRange(pageIndex, pageIndex);
    }
}
