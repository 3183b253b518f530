package org.marcdb.ingest_service.resolution;

public enum MatchStatus {
  UNIQUE,
  AMBIGUOUS,
  NONE
}
