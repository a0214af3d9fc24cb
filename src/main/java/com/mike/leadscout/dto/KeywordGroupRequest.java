package com.mike.leadscout.dto;

import java.util.List;

public record KeywordGroupRequest(List<String> keywords) {}
