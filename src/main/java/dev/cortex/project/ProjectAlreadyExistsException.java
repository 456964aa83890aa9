package dev.cortex.project;

/** A project with the requested id already exists. */
public class ProjectAlreadyExistsException extends RuntimeException {

  public ProjectAlreadyExistsException(String id) {
    super("Project '" + id + "' already exists");
  }

  public ProjectAlreadyExistsException(String id, Throwable cause) {
    super("Project '" + id + "' already exists", cause);
  }
}
