package com.ukdataalerts.coronavirus.engine;

import java.util.Collection;

public class AmbiguousAreaCodeException extends FatalInputException {

    public AmbiguousAreaCodeException(String areaName, Collection<String> areaCodes) {
        super("Unexpected area codes found: " + areaCodes + " for area name: " + areaName);
    }
}
