package com.programmersdiary.promptalchemy.credential;

public enum StorageLocation {
    VAULT,
    FILE,
    NONE
}
