package com.flamingo.ai.rulesindex.service.rag.model;

public enum Confidence {
  HIGH,
  MEDIUM,
  LOW
}
