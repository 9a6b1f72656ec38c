package com.simscan.mapper.model;

import lombok.Data;

@Data
public class UserScanCount {
    private String username;
    private long scanCount;
}
