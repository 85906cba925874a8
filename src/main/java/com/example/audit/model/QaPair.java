package com.example.audit.model;

/**
 * A question asked about the audited project and the answer given by its authors.
 */
public record QaPair(String question, String answer) {}
