package com.wangbin.uns.core.sparkplug.model;

import lombok.Builder;
import lombok.Value;

/**
 * 指标元数据，主要用于 Bytes / File 类型的分片传输。未设置的字段为 null。
 */
@Value
@Builder
public class MetaData {
    Boolean multiPart;
    String contentType;
    Long size;
    Long seq;
    String fileName;
    String fileType;
    String md5;
    String description;
}
