package com.fever.assessment.model;

public enum SessionMode {
  REMOTE,
  LOCAL
}
