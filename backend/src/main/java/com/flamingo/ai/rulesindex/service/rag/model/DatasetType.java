package com.flamingo.ai.rulesindex.service.rag.model;

public enum DatasetType {
  EQUIPMENT,
  SKILLS,
  INJURIES
}
