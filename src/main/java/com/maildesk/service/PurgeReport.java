package com.maildesk.service;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class PurgeReport {

    private int checked;
    private int matched;
    private int deleted;
    private boolean dryRun;
    private List<String> errors = new ArrayList<>();
}
