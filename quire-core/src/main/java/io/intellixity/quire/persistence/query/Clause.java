package io.intellixity.quire.persistence.query;

public enum Clause { AND, OR }
