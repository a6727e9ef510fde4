package com.ttennebkram.blobfinder.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;
import org.opencv.core.KeyPoint;

class BlobTest {

    @Test
    void fromKeyPointUsesKeyPointSizeAsDiameter() {
        Blob blob = Blob.fromKeyPoint(new KeyPoint(12.5f, 40.25f, 30f));

        assertEquals(12.5, blob.getX());
        assertEquals(40.25, blob.getY());
        assertEquals(30.0, blob.getSize());
        assertEquals(15.0, blob.getRadius());
    }

    @Test
    void toJsonCarriesCenterAndSize() {
        JsonObject json = new Blob(1.5, 2.5, 10).toJson();

        assertEquals(1.5, json.get("x").getAsDouble());
        assertEquals(2.5, json.get("y").getAsDouble());
        assertEquals(10.0, json.get("size").getAsDouble());
    }

    @Test
    void equalityIsByValue() {
        assertEquals(new Blob(1, 2, 3), new Blob(1, 2, 3));
        assertEquals(new Blob(1, 2, 3).hashCode(), new Blob(1, 2, 3).hashCode());
        assertNotEquals(new Blob(1, 2, 3), new Blob(1, 2, 4));
    }
}
