package uk.gegc.linguapractice.shared.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Converter
public class UuidListConverter extends JsonAttributeConverter<List<UUID>> {

    public UuidListConverter() {
        super(new TypeReference<>() {
        }, ArrayList::new);
    }
}
