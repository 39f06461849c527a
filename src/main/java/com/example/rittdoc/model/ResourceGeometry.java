package com.example.rittdoc.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResourceGeometry {
    private Integer width;
    private Integer height;
    private boolean vector;
    private long fileSize;

    public boolean isRaster() {
        return !vector;
    }
}
