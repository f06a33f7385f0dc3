package io.intellixity.strata.persistence.repository;

import io.intellixity.strata.persistence.hooks.*;
import io.intellixity.strata.persistence.mapping.ColumnTypes;
import io.intellixity.strata.persistence.model.EntityMapping;
import io.intellixity.strata.persistence.model.Model;

import java.util.ArrayList;
import java.util.List;

class Cat extends Model implements ValidateHook, BeforeSaveHook, AfterSaveHook, BeforeCreateHook, AfterCreateHook,
    BeforeUpdateHook, AfterUpdateHook, BeforeDeleteHook, AfterDeleteHook, AfterFindHook {
  static final EntityMapping<Cat> MAPPING = EntityMapping.builder(Cat.class, "cats", Cat::new)
      .column("name", ColumnTypes.string(), Cat::getName, Cat::setName)
      .column("age", ColumnTypes.integer(), Cat::getAge, Cat::setAge)
      .build();

  private String name;
  private Integer age;

  List<String> events = new ArrayList<>();
  String rejectIn;

  Cat() {}

  Cat(String name, int age) {
    this.name = name;
    this.age = age;
  }

  String getName() { return name; }
  void setName(String name) { this.name = name; }
  Integer getAge() { return age; }
  void setAge(Integer age) { this.age = age; }

  private void hook(String name) {
    events.add(name);
    if (name.equals(rejectIn)) throw new IllegalArgumentException(name + " rejected " + this.name);
  }

  @Override public void validate() { hook("validate"); }
  @Override public void beforeSave() { hook("beforeSave"); }
  @Override public void afterSave() { hook("afterSave"); }
  @Override public void beforeCreate() { hook("beforeCreate"); }
  @Override public void afterCreate() { hook("afterCreate"); }
  @Override public void beforeUpdate() { hook("beforeUpdate"); }
  @Override public void afterUpdate() { hook("afterUpdate"); }
  @Override public void beforeDelete() { hook("beforeDelete"); }
  @Override public void afterDelete() { hook("afterDelete"); }
  @Override public void afterFind() { hook("afterFind"); }
}
