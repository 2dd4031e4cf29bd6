package ae.teletronics.attachment.domain;

public enum LifecycleEvent {
    VALIDATE,
    SAVE,
    DESTROY,
    DISCARD
}
