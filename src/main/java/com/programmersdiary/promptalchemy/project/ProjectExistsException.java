package com.programmersdiary.promptalchemy.project;

public class ProjectExistsException extends IllegalArgumentException {

    public ProjectExistsException(String name, String slug) {
        super("Project '" + name + "' already exists (directory '" + slug + "')");
    }
}
