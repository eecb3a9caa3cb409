package com.fever.assessment.model;

public final class FeverTypes {
  public static final String VIRAL_FEVER = "Viral Fever";
  public static final String GENERAL_SYMPTOMS = "General Symptoms";
  public static final String NO_FEVER = "No Fever";

  private FeverTypes() {
  }
}
