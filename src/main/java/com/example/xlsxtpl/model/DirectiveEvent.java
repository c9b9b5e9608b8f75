package com.example.xlsxtpl.model;

import lombok.Value;

/**
 * A directive found on one grid line during a scan.
 */
@Value
public class DirectiveEvent {
    int position;
    Directive directive;
}
