package com.example.deltacode.web;

import com.example.deltacode.domain.SnapshotInput;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

@Component
public class MultipartSnapshotInputAdapter {
    public SnapshotInput adapt(String label, MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Inventory file for the " + label + " snapshot must not be empty");
        }
        return new SnapshotInput(label, describeFilename(file), file::getInputStream);
    }

    public String describeFilename(MultipartFile file) {
        if (file == null) {
            return "no file";
        }
        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || originalFilename.isBlank()) {
            return file.getName();
        }
        return originalFilename;
    }
}
