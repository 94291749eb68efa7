package com.example.logfilter.filter.models;

public enum CombinationMode {
    AND,
    OR
}
