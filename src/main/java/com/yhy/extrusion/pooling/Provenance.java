package com.yhy.extrusion.pooling;

import com.yhy.extrusion.vo.CutItem;
import lombok.Value;

/**
 * How many pieces of a pooled item one caller item contributed.
 */
@Value
public class Provenance {
    CutItem source;
    int quantity;
}
