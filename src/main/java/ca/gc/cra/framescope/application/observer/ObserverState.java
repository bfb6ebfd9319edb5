package ca.gc.cra.framescope.application.observer;

/** Lifecycle states of a {@link PipelineObserver}. */
public enum ObserverState {
  /** Not attached, or torn down. Frames arriving while idle attach the observer unless it is closed. */
  IDLE,
  /** Attached; capturable frames are scheduled for background work. */
  ACTIVE,
  /** Reset or close in progress; frames are counted but nothing new is scheduled. */
  DRAINING
}
