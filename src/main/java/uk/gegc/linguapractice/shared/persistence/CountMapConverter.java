package uk.gegc.linguapractice.shared.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class CountMapConverter extends JsonAttributeConverter<Map<String, Integer>> {

    public CountMapConverter() {
        super(new TypeReference<>() {
        }, LinkedHashMap::new);
    }
}
