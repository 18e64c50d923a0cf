package de.bsommerfeld.rentalprice.model.evaluation;

public enum ModelStatus {
    TRAINED,
    FAILED
}
