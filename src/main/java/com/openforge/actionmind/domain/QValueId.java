package com.openforge.actionmind.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/** Composite key of {@link QValue}: (state fingerprint, action). */
@Getter
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class QValueId implements Serializable {

    private String stateHash;
    private String action;
}
