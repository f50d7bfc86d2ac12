package com.example.deltacode.application;

import com.example.deltacode.domain.Delta;

public interface DeltaRenderer {
    String render(Delta delta, int contextSize);
}
