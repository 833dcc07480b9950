package org.dxworks.gedframe.model;

import java.util.ArrayList;
import java.util.List;

public class IndividualData {
    public String name;
    public String firstName;
    public String lastName;
    public String sex;
    public EventData birth;
    public EventData death;
    public List<String> media = new ArrayList<>();
}
