package com.ledgerwise.anomaly.model;

public enum AlgorithmType {
    STATISTICAL,
    ML_ISOLATION_FOREST,
    ML_ONE_CLASS_SVM,
    LSTM_AUTOENCODER,
    ENSEMBLE
}
